package com.nosota.mshop.api.dto;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@EqualsAndHashCode
public class ItemDTO {
    private Long id;
    private String name;
    private String icon;
    private String description;
    private Long price;
    private String createdBy;
    private LocalDateTime createdAt;
}

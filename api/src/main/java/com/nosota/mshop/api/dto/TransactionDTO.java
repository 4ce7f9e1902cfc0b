package com.nosota.mshop.api.dto;

import com.nosota.mshop.api.model.TransactionStatus;
import com.nosota.mshop.api.model.TransactionType;
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
public class TransactionDTO {
    private Long id;
    private Long userId;
    private TransactionType type;
    private Long amount;
    private Long itemId;
    private TransactionStatus status;
    private String description;
    private LocalDateTime createdAt;
}

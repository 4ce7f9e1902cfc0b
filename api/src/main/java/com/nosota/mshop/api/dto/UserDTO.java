package com.nosota.mshop.api.dto;

import com.nosota.mshop.api.model.UserRole;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Public view of an account. The password hash is never part of it.
 */
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@EqualsAndHashCode
public class UserDTO {
    private Long id;
    private String name;
    private String username;
    private String email;
    private UserRole role;
    private Long wallet;
}

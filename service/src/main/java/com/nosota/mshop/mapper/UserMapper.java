package com.nosota.mshop.mapper;

import com.nosota.mshop.api.dto.UserDTO;
import com.nosota.mshop.model.User;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

import java.util.List;

/**
 * MapStruct mapper for User entity to its public view. The password hash has no target.
 */
@Mapper
public interface UserMapper {

    UserMapper INSTANCE = Mappers.getMapper(UserMapper.class);

    UserDTO toDTO(User user);

    List<UserDTO> toDTOList(List<User> users);
}

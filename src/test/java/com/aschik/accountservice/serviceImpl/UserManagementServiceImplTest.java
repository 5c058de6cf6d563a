package com.aschik.accountservice.serviceImpl;

import com.aschik.accountservice.entity.User;
import com.aschik.accountservice.exception.UserExceptions;
import com.aschik.accountservice.repository.UserRepository;
import com.aschik.accountservice.service.OtpService;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class UserManagementServiceImplTest {

    private final UserRepository userRepository = Mockito.mock(UserRepository.class);
    private final OtpService otpService = Mockito.mock(OtpService.class);
    private final UserServiceImpl userService = Mockito.mock(UserServiceImpl.class);
    private final UserManagementServiceImpl service =
            new UserManagementServiceImpl(userRepository, otpService, userService);

    @Test
    void deleteUser_should_soft_delete_and_evict() {
        UUID id = UUID.randomUUID();
        User user = User.builder().handle("bob").email("bob@example.com").password("x").build();
        Mockito.when(userRepository.findActiveById(id)).thenReturn(Optional.of(user));

        service.deleteUser(id);

        assertThat(user.isDeleted()).isTrue();
        Mockito.verify(userRepository).save(user);
        Mockito.verify(userService).evictUserDetails("bob@example.com");
    }

    @Test
    void unknown_ids_should_be_not_found() {
        UUID id = UUID.randomUUID();
        Mockito.when(userRepository.findActiveById(id)).thenReturn(Optional.empty());

        assertThrows(UserExceptions.UserNotFound.class, () -> service.getUser(id));
        assertThrows(UserExceptions.UserNotFound.class, () -> service.deleteUser(id));
        assertThrows(UserExceptions.UserNotFound.class, () -> service.passcodeHistory(id));
    }

    @Test
    void listUsers_should_map_summaries() {
        Mockito.when(userRepository.findAllActiveUsers()).thenReturn(List.of(
                User.builder().handle("a_user").email("a@example.com").password("x").build(),
                User.builder().handle("b_user").email("b@example.com").password("x").emailVerified(true).build()));

        assertThat(service.listUsers()).extracting("username").containsExactly("a_user", "b_user");
    }
}

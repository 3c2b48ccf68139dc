package com.ruian.service;

import com.ruian.entity.User;
import com.ruian.exception.ResourceNotFoundException;
import com.ruian.repository.UserRepository;
import com.ruian.service.UserAccountService.CreateResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("UserAccountService Unit Tests")
class UserAccountServiceTest {

    @Mock
    private UserRepository userRepository;

    @Mock
    private PasswordEncoder passwordEncoder;

    @InjectMocks
    private UserAccountService userAccountService;

    @Test
    @DisplayName("createUser should store a trimmed username with an encoded password")
    void testCreateUser_Created() {
        when(userRepository.existsByUsername("worker01")).thenReturn(false);
        when(passwordEncoder.encode("secret123")).thenReturn("encoded");
        when(userRepository.save(any(User.class))).thenAnswer(invocation -> invocation.getArgument(0));

        CreateResult result = userAccountService.createUser(" worker01 ", "secret123", true);

        assertEquals(CreateResult.CREATED, result);
        ArgumentCaptor<User> captor = ArgumentCaptor.forClass(User.class);
        verify(userRepository).save(captor.capture());
        assertEquals("worker01", captor.getValue().getUsername());
        assertEquals("encoded", captor.getValue().getPasswordHash());
    }

    @Test
    @DisplayName("createUser should skip an existing username when asked to")
    void testCreateUser_SkipExisting() {
        when(userRepository.existsByUsername("worker01")).thenReturn(true);

        assertEquals(CreateResult.SKIPPED, userAccountService.createUser("worker01", "secret123", true));
        verify(userRepository, never()).save(any());
    }

    @Test
    @DisplayName("createUser should reject an existing username when not skipping")
    void testCreateUser_ExistingRejected() {
        when(userRepository.existsByUsername("worker01")).thenReturn(true);

        assertThrows(IllegalArgumentException.class,
                () -> userAccountService.createUser("worker01", "secret123", false));
        verify(userRepository, never()).save(any());
    }

    @Test
    @DisplayName("createUser should enforce username and password lengths")
    void testCreateUser_InvalidInput() {
        assertThrows(IllegalArgumentException.class,
                () -> userAccountService.createUser("worker01", "12345", true));
        assertThrows(IllegalArgumentException.class,
                () -> userAccountService.createUser("x".repeat(51), "secret123", true));
        assertThrows(IllegalArgumentException.class,
                () -> userAccountService.createUser("  ", "secret123", true));
        verifyNoInteractions(userRepository, passwordEncoder);
    }

    @Test
    @DisplayName("changePassword should replace the stored hash")
    void testChangePassword_Success() {
        User user = new User("worker01", "old-hash");
        when(userRepository.findByUsername("worker01")).thenReturn(Optional.of(user));
        when(passwordEncoder.encode("newsecret")).thenReturn("new-hash");

        userAccountService.changePassword("worker01", "newsecret");

        assertEquals("new-hash", user.getPasswordHash());
        verify(userRepository).save(user);
    }

    @Test
    @DisplayName("changePassword should throw ResourceNotFoundException for an unknown user")
    void testChangePassword_UnknownUser() {
        when(userRepository.findByUsername("ghost")).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class,
                () -> userAccountService.changePassword("ghost", "newsecret"));
        verify(passwordEncoder, never()).encode(any());
    }
}

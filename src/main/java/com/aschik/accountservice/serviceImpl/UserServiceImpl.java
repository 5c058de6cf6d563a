package com.aschik.accountservice.serviceImpl;

import com.aschik.accountservice.config.CacheConfig;
import com.aschik.accountservice.entity.User;
import com.aschik.accountservice.repository.UserRepository;
import com.aschik.accountservice.utils.EmailAddresses;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserServiceImpl implements UserDetailsService {

    private final UserRepository userRepository;

    /**
     * Unverified accounts still load: sign-in answers them with a verification
     * prompt instead of a token, so they must get past credential checks.
     */
    @Override
    @Transactional(readOnly = true)
    @Cacheable(
            cacheNames = CacheConfig.USER_DETAILS_BY_EMAIL,
            keyGenerator = "lowerCaseStringKeyGenerator",
            unless = "#result == null",
            sync = true
    )
    public UserDetails loadUserByUsername(String email) throws UsernameNotFoundException {
        if (email == null) throw new UsernameNotFoundException("User not found");
        final String normalized = EmailAddresses.normalize(email);
        log.debug("Loading user by email: {}", normalized);

        User user = userRepository.findByEmail(normalized)
                .orElseThrow(() -> new UsernameNotFoundException("User not found"));

        // generic error for unusable accounts (no enumeration)
        if (user.isDeleted()) {
            throw new UsernameNotFoundException("User not found");
        }
        return user;
    }

    /** Drops the cached principal after its password, verification flag or existence changed. */
    @CacheEvict(cacheNames = CacheConfig.USER_DETAILS_BY_EMAIL, keyGenerator = "lowerCaseStringKeyGenerator")
    public void evictUserDetails(String email) {
        log.debug("Evicted cached user details for {}", email);
    }
}

package com.flagship.admissions_payment.user;

import com.flagship.admissions_payment.payment.exception.UserNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class UserService {

    private final UserRepository userRepository;

    /**
     * Idempotently records the application among the user's enrolled programs.
     *
     * @return true if the application was newly added
     * @throws UserNotFoundException if the user does not exist
     */
    @Transactional
    public boolean addEnrolledProgram(UUID userId, UUID applicationId) {
        if (!userRepository.existsById(userId)) {
            throw new UserNotFoundException(userId);
        }
        boolean added = userRepository.addEnrolledProgram(userId, applicationId) > 0;
        log.info("Enrolled program {} for user {} (newly added: {})", applicationId, userId, added);
        return added;
    }

    @Transactional(readOnly = true)
    public boolean isEnrolled(UUID userId, UUID applicationId) {
        return userRepository.countEnrollment(userId, applicationId) > 0;
    }
}

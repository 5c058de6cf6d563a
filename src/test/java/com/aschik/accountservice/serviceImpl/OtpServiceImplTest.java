package com.aschik.accountservice.serviceImpl;

import com.aschik.accountservice.config.OtpProperties;
import com.aschik.accountservice.dto.OtpIssueResult;
import com.aschik.accountservice.dto.PasscodeHistoryEntry;
import com.aschik.accountservice.entity.PasscodePurpose;
import com.aschik.accountservice.exception.OtpExceptions;
import com.aschik.accountservice.exception.RequestExceptions;
import com.aschik.accountservice.service.NotificationDispatcher;
import com.aschik.accountservice.testsupport.InMemoryPasscodeStore;
import com.aschik.accountservice.testsupport.MutableClock;
import com.aschik.accountservice.utils.PasscodeGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.mail.MailSendException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.aschik.accountservice.entity.PasscodePurpose.EMAIL_VERIFICATION;
import static com.aschik.accountservice.entity.PasscodePurpose.PASSWORD_RESET;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.*;

class OtpServiceImplTest {

    private static final String EMAIL = "user@example.com";

    private MutableClock clock;
    private InMemoryPasscodeStore store;
    private NotificationDispatcher dispatcher;
    private OtpServiceImpl otpService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        store = new InMemoryPasscodeStore(clock);
        dispatcher = Mockito.mock(NotificationDispatcher.class);
        otpService = new OtpServiceImpl(store, dispatcher, new PasscodeGenerator(),
                new OtpProperties(6, 10, "0 15 * * * *"), clock);
    }

    @Test
    void issue_should_store_one_code_and_mail_it() {
        OtpIssueResult result = otpService.issue(EMAIL, EMAIL_VERIFICATION);

        String code = lastMailedCode(1);
        assertThat(code).matches("\\d{6}");
        assertThat(result.getEmail()).isEqualTo(EMAIL);
        assertThat(result.getExpiresInMinutes()).isEqualTo(10);
        assertThat(result.getExpiresAt()).isEqualTo(Instant.parse("2026-03-01T10:10:00Z"));
        assertThat(store.outstanding(EMAIL, EMAIL_VERIFICATION)).isEqualTo(1);
    }

    @Test
    void issue_should_normalize_the_address() {
        OtpIssueResult result = otpService.issue("  User@Example.COM ", PASSWORD_RESET);

        assertThat(result.getEmail()).isEqualTo(EMAIL);
        Mockito.verify(dispatcher).send(eq(EMAIL), eq(PASSWORD_RESET), anyString(), eq(10));
    }

    @Test
    void reissue_should_invalidate_the_previous_code() {
        otpService.issue(EMAIL, PASSWORD_RESET);
        String first = lastMailedCode(1);
        otpService.issue(EMAIL, PASSWORD_RESET);
        String second = lastMailedCode(2);

        assertThat(store.outstanding(EMAIL, PASSWORD_RESET)).isEqualTo(1);
        if (!first.equals(second)) {
            assertThrows(OtpExceptions.InvalidOrExpiredCode.class,
                    () -> otpService.verify(EMAIL, first, PASSWORD_RESET));
        }
        assertThatCode(() -> otpService.verify(EMAIL, second, PASSWORD_RESET)).doesNotThrowAnyException();
    }

    @Test
    void reissue_should_leave_the_other_purpose_alone() {
        otpService.issue(EMAIL, EMAIL_VERIFICATION);
        otpService.issue(EMAIL, PASSWORD_RESET);

        assertThat(store.outstanding(EMAIL, EMAIL_VERIFICATION)).isEqualTo(1);
        assertThat(store.outstanding(EMAIL, PASSWORD_RESET)).isEqualTo(1);
    }

    @Test
    void verify_should_consume_the_code_exactly_once() {
        otpService.issue(EMAIL, EMAIL_VERIFICATION);
        String code = lastMailedCode(1);

        otpService.verify(EMAIL, code, EMAIL_VERIFICATION);

        assertThrows(OtpExceptions.InvalidOrExpiredCode.class,
                () -> otpService.verify(EMAIL, code, EMAIL_VERIFICATION));
        assertThat(store.outstanding(EMAIL, EMAIL_VERIFICATION)).isZero();
    }

    @Test
    void verify_should_accept_mixed_case_address_and_padded_code() {
        otpService.issue(EMAIL, EMAIL_VERIFICATION);
        String code = lastMailedCode(1);

        assertThatCode(() -> otpService.verify(" USER@example.com", " " + code + " ", EMAIL_VERIFICATION))
                .doesNotThrowAnyException();
    }

    @Test
    void verify_should_reject_code_after_expiry() {
        otpService.issue(EMAIL, PASSWORD_RESET);
        String code = lastMailedCode(1);

        clock.advance(Duration.ofMinutes(10));

        assertThrows(OtpExceptions.InvalidOrExpiredCode.class,
                () -> otpService.verify(EMAIL, code, PASSWORD_RESET));
    }

    @Test
    void verify_should_accept_code_just_before_expiry() {
        otpService.issue(EMAIL, PASSWORD_RESET);
        String code = lastMailedCode(1);

        clock.advance(Duration.ofMinutes(10).minusSeconds(1));

        assertThatCode(() -> otpService.verify(EMAIL, code, PASSWORD_RESET)).doesNotThrowAnyException();
    }

    @Test
    void verify_should_not_cross_purposes() {
        otpService.issue(EMAIL, EMAIL_VERIFICATION);
        String code = lastMailedCode(1);

        assertThrows(OtpExceptions.InvalidOrExpiredCode.class,
                () -> otpService.verify(EMAIL, code, PASSWORD_RESET));
        // still usable for the purpose it was issued for
        assertThatCode(() -> otpService.verify(EMAIL, code, EMAIL_VERIFICATION)).doesNotThrowAnyException();
    }

    @Test
    void wrong_code_should_leave_the_outstanding_one_usable() {
        otpService.issue(EMAIL, EMAIL_VERIFICATION);
        String code = lastMailedCode(1);
        String wrong = code.equals("000000") ? "111111" : "000000";

        assertThrows(OtpExceptions.InvalidOrExpiredCode.class,
                () -> otpService.verify(EMAIL, wrong, EMAIL_VERIFICATION));
        assertThatCode(() -> otpService.verify(EMAIL, code, EMAIL_VERIFICATION)).doesNotThrowAnyException();
    }

    @Test
    void verify_should_reject_blank_input_uniformly() {
        assertThrows(OtpExceptions.InvalidOrExpiredCode.class,
                () -> otpService.verify(EMAIL, "  ", EMAIL_VERIFICATION));
        assertThrows(OtpExceptions.InvalidOrExpiredCode.class,
                () -> otpService.verify(null, "123456", EMAIL_VERIFICATION));
    }

    @Test
    void issue_should_reject_malformed_address_before_any_side_effect() {
        assertThrows(RequestExceptions.ValidationFailed.class,
                () -> otpService.issue("not-an-email", EMAIL_VERIFICATION));

        assertThat(store.history("not-an-email", 10)).isEmpty();
        Mockito.verifyNoInteractions(dispatcher);
    }

    @Test
    void failed_delivery_should_surface_but_keep_the_stored_code() {
        ArgumentCaptor<String> code = ArgumentCaptor.forClass(String.class);
        Mockito.doThrow(new OtpExceptions.DeliveryFailed("Failed to send email", new MailSendException("down")))
                .when(dispatcher).send(eq(EMAIL), eq(PASSWORD_RESET), code.capture(), anyInt());

        assertThrows(OtpExceptions.DeliveryFailed.class, () -> otpService.issue(EMAIL, PASSWORD_RESET));

        assertThat(store.outstanding(EMAIL, PASSWORD_RESET)).isEqualTo(1);
        assertThatCode(() -> otpService.verify(EMAIL, code.getValue(), PASSWORD_RESET)).doesNotThrowAnyException();
    }

    @Test
    void concurrent_verification_should_succeed_for_exactly_one_caller() throws Exception {
        otpService.issue(EMAIL, PASSWORD_RESET);
        String code = lastMailedCode(1);

        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Callable<Boolean> attempt = () -> {
                start.await();
                try {
                    otpService.verify(EMAIL, code, PASSWORD_RESET);
                    return true;
                } catch (OtpExceptions.InvalidOrExpiredCode e) {
                    return false;
                }
            };
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                results.add(pool.submit(attempt));
            }
            start.countDown();

            int successes = 0;
            for (Future<Boolean> f : results) {
                if (f.get(5, TimeUnit.SECONDS)) successes++;
            }
            assertThat(successes).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void history_should_list_newest_first_without_codes() {
        otpService.issue(EMAIL, EMAIL_VERIFICATION);
        clock.advance(Duration.ofMinutes(1));
        otpService.issue(EMAIL, PASSWORD_RESET);

        List<PasscodeHistoryEntry> history = otpService.history(EMAIL);

        assertThat(history).extracting(PasscodeHistoryEntry::getPurpose)
                .containsExactly(PASSWORD_RESET, EMAIL_VERIFICATION);
        assertThat(history).allSatisfy(e -> assertThat(e.isUsed()).isFalse());
    }

    private String lastMailedCode(int expectedSends) {
        ArgumentCaptor<String> code = ArgumentCaptor.forClass(String.class);
        Mockito.verify(dispatcher, Mockito.times(expectedSends))
                .send(anyString(), any(PasscodePurpose.class), code.capture(), anyInt());
        return code.getValue();
    }
}

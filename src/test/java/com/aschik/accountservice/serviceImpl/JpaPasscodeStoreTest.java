package com.aschik.accountservice.serviceImpl;

import com.aschik.accountservice.config.ClockConfig;
import com.aschik.accountservice.entity.Passcode;
import com.aschik.accountservice.repository.PasscodeRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.aschik.accountservice.entity.PasscodePurpose.EMAIL_VERIFICATION;
import static com.aschik.accountservice.entity.PasscodePurpose.PASSWORD_RESET;
import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import({JpaPasscodeStore.class, ClockConfig.class})
class JpaPasscodeStoreTest {

    private static final String EMAIL = "user@example.com";

    @Autowired
    JpaPasscodeStore store;

    @Autowired
    PasscodeRepository repository;

    private final Instant now = Instant.now();
    private final Instant inTenMinutes = now.plus(Duration.ofMinutes(10));

    @Test
    void replaceOutstanding_should_keep_a_single_row_per_email_and_purpose() {
        store.replaceOutstanding(EMAIL, "111111", PASSWORD_RESET, inTenMinutes);
        store.replaceOutstanding(EMAIL, "222222", PASSWORD_RESET, inTenMinutes);
        store.replaceOutstanding(EMAIL, "333333", EMAIL_VERIFICATION, inTenMinutes);

        assertThat(repository.findAll())
                .filteredOn(p -> p.getPurpose() == PASSWORD_RESET)
                .extracting(Passcode::getCode)
                .containsExactly("222222");
        assertThat(store.findValid(EMAIL, "111111", PASSWORD_RESET, now)).isEmpty();
        assertThat(store.findValid(EMAIL, "222222", PASSWORD_RESET, now)).isPresent();
        assertThat(store.findValid(EMAIL, "333333", EMAIL_VERIFICATION, now)).isPresent();
    }

    @Test
    void consume_should_succeed_once_and_record_usage() {
        store.replaceOutstanding(EMAIL, "123456", EMAIL_VERIFICATION, inTenMinutes);

        assertThat(store.consume(EMAIL, "123456", EMAIL_VERIFICATION, now)).isTrue();
        assertThat(store.consume(EMAIL, "123456", EMAIL_VERIFICATION, now)).isFalse();

        Passcode row = repository.findAll().get(0);
        assertThat(row.isUsed()).isTrue();
        assertThat(row.getUsedAt()).isNotNull();
    }

    @Test
    void markUsed_should_only_flip_an_unused_row() {
        Passcode p = store.insert(EMAIL, "654321", PASSWORD_RESET, inTenMinutes);

        assertThat(store.markUsed(p.getId(), now)).isTrue();
        assertThat(store.markUsed(p.getId(), now)).isFalse();
    }

    @Test
    void findValid_should_ignore_expired_rows_even_before_purge() {
        store.insert(EMAIL, "123456", PASSWORD_RESET, now.minusSeconds(1));

        assertThat(store.findValid(EMAIL, "123456", PASSWORD_RESET, now)).isEmpty();
        assertThat(store.consume(EMAIL, "123456", PASSWORD_RESET, now)).isFalse();
        assertThat(repository.count()).isEqualTo(1);
    }

    @Test
    void findValid_should_require_the_matching_purpose() {
        store.insert(EMAIL, "123456", EMAIL_VERIFICATION, inTenMinutes);

        assertThat(store.findValid(EMAIL, "123456", PASSWORD_RESET, now)).isEmpty();
    }

    @Test
    void purgeExpired_should_delete_only_expired_rows() {
        store.insert(EMAIL, "111111", PASSWORD_RESET, now.minus(Duration.ofMinutes(1)));
        store.insert("other@example.com", "222222", PASSWORD_RESET, now.minus(Duration.ofHours(2)));
        store.insert(EMAIL, "333333", EMAIL_VERIFICATION, inTenMinutes);

        int removed = store.purgeExpired(now);

        assertThat(removed).isEqualTo(2);
        assertThat(repository.findAll()).extracting(Passcode::getCode).containsExactly("333333");
    }

    @Test
    void history_should_return_newest_first_and_respect_the_limit() {
        store.insert(EMAIL, "111111", PASSWORD_RESET, inTenMinutes);
        store.insert(EMAIL, "222222", EMAIL_VERIFICATION, inTenMinutes);
        store.insert(EMAIL, "333333", PASSWORD_RESET, inTenMinutes);

        List<Passcode> history = store.history(EMAIL, 2);

        assertThat(history).extracting(Passcode::getCode).containsExactly("333333", "222222");
    }
}

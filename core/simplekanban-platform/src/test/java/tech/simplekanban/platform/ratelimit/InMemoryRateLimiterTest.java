package tech.simplekanban.platform.ratelimit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.simplekanban.platform.testing.MutableClock;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class InMemoryRateLimiterTest {

    private MutableClock clock;
    private InMemoryRateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-06-01T10:00:00Z"));
        limiter = new InMemoryRateLimiter(50, Duration.ofSeconds(60), 1000, clock);
    }

    @Test
    @DisplayName("check should count requests cumulatively within the window")
    void check_shouldDecrementRemaining_perAllowedRequest() {
        assertThat(limiter.check("ip:1.2.3.4").remaining()).isEqualTo(49);
        assertThat(limiter.check("ip:1.2.3.4").remaining()).isEqualTo(48);
        assertThat(limiter.check("ip:1.2.3.4").limit()).isEqualTo(50);
    }

    @Test
    @DisplayName("check should deny everything past the ceiling within one window")
    void check_shouldDenyRequestsBeyondCeiling_whenBurstExceedsLimit() {
        // Arrange
        List<RateLimitDecision> decisions = new ArrayList<>();

        // Act
        for (int i = 0; i < 100; i++) {
            decisions.add(limiter.check("ip:1.2.3.4"));
            clock.advance(Duration.ofMillis(100));
        }

        // Assert
        assertThat(decisions.subList(0, 50)).allMatch(RateLimitDecision::allowed);
        assertThat(decisions.subList(50, 100)).noneMatch(RateLimitDecision::allowed);
        Duration previous = Duration.ZERO;
        for (RateLimitDecision denied : decisions.subList(50, 100)) {
            assertThat(denied.retryAfter()).isPositive().isGreaterThanOrEqualTo(previous);
            previous = denied.retryAfter();
        }
    }

    @Test
    @DisplayName("check should not count denied requests against the window")
    void check_shouldAdmitAgain_whenOldestRequestLeavesWindow() {
        // Arrange
        for (int i = 0; i < 50; i++) {
            limiter.check("ip:1.2.3.4");
        }
        for (int i = 0; i < 20; i++) {
            assertThat(limiter.check("ip:1.2.3.4").allowed()).isFalse();
        }

        // Act
        clock.advance(Duration.ofSeconds(60));

        // Assert
        RateLimitDecision decision = limiter.check("ip:1.2.3.4");
        assertThat(decision.allowed()).isTrue();
        assertThat(decision.remaining()).isEqualTo(49);
    }

    @Test
    @DisplayName("check should report the same retry-after of one window for every denial")
    void check_shouldKeepRetryAfterStable_whileThrottled() {
        // Arrange
        for (int i = 0; i < 50; i++) {
            limiter.check("ip:1.2.3.4");
        }

        // Act
        clock.advance(Duration.ofSeconds(15));
        RateLimitDecision first = limiter.check("ip:1.2.3.4");
        clock.advance(Duration.ofSeconds(30));
        RateLimitDecision later = limiter.check("ip:1.2.3.4");

        // Assert
        assertThat(first.allowed()).isFalse();
        assertThat(later.allowed()).isFalse();
        assertThat(first.retryAfter()).isEqualTo(Duration.ofSeconds(60));
        assertThat(later.retryAfter()).isEqualTo(first.retryAfter());
    }

    @Test
    @DisplayName("check should keep separate windows per client key")
    void check_shouldIsolateClients() {
        for (int i = 0; i < 50; i++) {
            limiter.check("user:usr_1");
        }

        assertThat(limiter.check("user:usr_1").allowed()).isFalse();
        assertThat(limiter.check("user:usr_2").allowed()).isTrue();
    }

    @Test
    @DisplayName("check should never admit more than the ceiling under concurrent requests")
    void check_shouldNotUnderCount_whenConcurrent() throws Exception {
        // Arrange
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            results.add(pool.submit(() -> {
                start.await();
                return limiter.check("ip:9.9.9.9").allowed();
            }));
        }

        // Act
        start.countDown();
        int allowed = 0;
        for (Future<Boolean> result : results) {
            if (result.get(10, TimeUnit.SECONDS)) {
                allowed++;
            }
        }
        pool.shutdown();

        // Assert
        assertThat(allowed).isEqualTo(50);
    }

    @Test
    @DisplayName("constructor should reject a non-positive ceiling")
    void constructor_shouldReject_whenMaxRequestsNotPositive() {
        assertThatThrownBy(() -> new InMemoryRateLimiter(0, Duration.ofSeconds(1), 10, clock))
            .isInstanceOf(IllegalArgumentException.class);
    }
}

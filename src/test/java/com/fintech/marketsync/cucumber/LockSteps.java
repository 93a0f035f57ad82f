package com.fintech.marketsync.cucumber;

import com.fintech.marketsync.config.MarketDataProperties;
import com.fintech.marketsync.coordination.DistributedLockService;
import com.fintech.marketsync.coordination.LockToken;
import com.fintech.marketsync.support.InMemoryCandleCache;
import com.fintech.marketsync.support.MutableClock;
import io.cucumber.java.en.Given;
import io.cucumber.java.en.Then;
import io.cucumber.java.en.When;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Step definitions for lock coordination between workers sharing one cache.
 */
public class LockSteps {

    private final MutableClock clock = MutableClock.atEpochSecond(1_704_067_200L);
    private final InMemoryCandleCache cache = new InMemoryCandleCache(clock);
    private final Map<String, DistributedLockService> workers = new HashMap<>();
    private final Map<String, LockToken> tokens = new HashMap<>();
    private final Map<String, Boolean> ran = new HashMap<>();

    private DistributedLockService worker(String name) {
        return workers.computeIfAbsent(name, n -> new DistributedLockService(cache, new MarketDataProperties()));
    }

    @Given("worker {string} holds the lock {string} for {int} seconds")
    public void workerHoldsTheLockFor(String name, String key, int seconds) {
        workerAcquiresTheLock(name, key, seconds);
    }

    @When("worker {string} acquires the lock {string} for {int} seconds")
    public void workerAcquiresTheLock(String name, String key, int seconds) {
        Optional<LockToken> token = worker(name).acquire(key, Duration.ofSeconds(seconds));
        token.ifPresent(t -> tokens.put(name, t));
    }

    @When("worker {string} runs a unit under {string}")
    public void workerRunsAUnit(String name, String key) {
        ran.put(name, false);
        boolean executed = worker(name).runExclusive(key, () -> ran.put(name, true));
        assertThat(executed).isEqualTo(ran.get(name));
    }

    @When("worker {string} releases its lock")
    public void workerReleasesItsLock(String name) {
        worker(name).release(tokens.get(name));
    }

    @When("{int} seconds pass")
    public void secondsPass(int seconds) {
        clock.advance(Duration.ofSeconds(seconds));
    }

    @Then("worker {string} did not run the unit")
    public void workerDidNotRun(String name) {
        assertThat(ran.get(name)).isFalse();
    }

    @Then("worker {string} ran the unit")
    public void workerRan(String name) {
        assertThat(ran.get(name)).isTrue();
    }

    @Then("worker {string} holds the lock {string}")
    public void workerHoldsLock(String name, String key) {
        assertThat(tokens).containsKey(name);
        assertThat(cache.get(key)).contains(tokens.get(name).owner());
    }

    @Then("the lock {string} is free")
    public void theLockIsFree(String key) {
        assertThat(cache.get(key)).isEmpty();
        assertThat(worker("observer").activeLocks()).doesNotContain(key);
    }
}

package com.cornerleague.collector.service.crawl;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

class PolitenessBudgetTest {

    @Test
    void perDomainLimit_blocksUntilAPermitIsReleased() throws Exception {
        PolitenessBudget budget = new PolitenessBudget(10, 2, 0);
        PolitenessBudget.Permit first = budget.acquire("espn.com", 0);
        PolitenessBudget.Permit second = budget.acquire("espn.com", 0);
        assertThat(budget.inFlight("espn.com")).isEqualTo(2);

        CountDownLatch acquired = new CountDownLatch(1);
        AtomicBoolean gotIt = new AtomicBoolean(false);
        Thread waiter = new Thread(() -> {
            try (PolitenessBudget.Permit ignored = budget.acquire("espn.com", 0)) {
                gotIt.set(true);
                acquired.countDown();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        waiter.start();

        assertThat(acquired.await(200, TimeUnit.MILLISECONDS)).isFalse();
        first.close();
        assertThat(acquired.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(gotIt.get()).isTrue();

        second.close();
        waiter.join(2000);
        assertThat(budget.inFlight("espn.com")).isZero();
    }

    @Test
    void domainsDoNotShareTheirLimit() throws Exception {
        PolitenessBudget budget = new PolitenessBudget(10, 1, 0);

        try (PolitenessBudget.Permit a = budget.acquire("espn.com", 0);
             PolitenessBudget.Permit b = budget.acquire("yahoo.com", 0)) {
            assertThat(budget.inFlight("espn.com")).isEqualTo(1);
            assertThat(budget.inFlight("yahoo.com")).isEqualTo(1);
        }
        assertThat(budget.inFlight("cbssports.com")).isZero();
    }

    @Test
    void closingTwice_releasesOnce() throws Exception {
        PolitenessBudget budget = new PolitenessBudget(10, 2, 0);
        PolitenessBudget.Permit permit = budget.acquire("espn.com", 0);

        permit.close();
        permit.close();

        assertThat(budget.inFlight("espn.com")).isZero();
    }

    @Test
    void crawlDelay_spacesRequestStarts() throws Exception {
        PolitenessBudget budget = new PolitenessBudget(10, 5, 1_000);

        long t0 = System.currentTimeMillis();
        budget.acquire("espn.com", 150).close();
        budget.acquire("espn.com", 150).close();

        assertThat(System.currentTimeMillis() - t0).isGreaterThanOrEqualTo(140);
    }
}

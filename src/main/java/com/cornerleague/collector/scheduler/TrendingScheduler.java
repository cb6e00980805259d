package com.cornerleague.collector.scheduler;

import com.cornerleague.collector.service.trending.TrendingDetector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Slf4j
@Component
@RequiredArgsConstructor
public class TrendingScheduler {

    private final TrendingDetector trendingDetector;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${trending.recompute-ms:300000}", initialDelayString = "${trending.initial-delay-ms:60000}")
    public void run() {
        try {
            trendingDetector.recompute(clock.instant());
        } catch (DataAccessException e) {
            log.error("Trending recompute failed, keeping previous ranking", e);
        }
    }
}

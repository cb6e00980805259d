package com.cornerleague.collector.source;

import com.cornerleague.collector.domain.dto.DiscoveredUrl;
import com.cornerleague.collector.domain.entity.Source;
import crawlercommons.robots.BaseRobotRules;

import java.util.List;

/**
 * One way of expanding a source into candidate article URLs.
 */
public interface DiscoverySource {

    String name();

    List<DiscoveredUrl> discover(Source source, BaseRobotRules robotRules);
}

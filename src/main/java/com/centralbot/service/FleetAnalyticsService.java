package com.centralbot.service;

import com.centralbot.dto.FleetAnalyticsDto;
import com.centralbot.dto.FleetAnalyticsDto.ActionBreakdown;
import com.centralbot.dto.FleetAnalyticsDto.DeviceDetail;
import com.centralbot.dto.FleetAnalyticsDto.FleetOverview;
import com.centralbot.dto.FleetAnalyticsDto.PerformanceMetrics;
import com.centralbot.entity.DeviceStatus;
import com.centralbot.repository.RegistrySnapshot;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

/**
 * Read-only analytics over the registry. Agent-reported numbers are summed
 * leniently: anything that is not a number counts as 0.
 */
@Service
@RequiredArgsConstructor
public class FleetAnalyticsService {

    static final int TOP_PERFORMERS = 3;

    private final FleetCoordinatorService fleetCoordinatorService;

    public FleetAnalyticsDto analytics() {
        return summarize(fleetCoordinatorService.currentFleet());
    }

    FleetAnalyticsDto summarize(RegistrySnapshot snapshot) {
        int totalDevices = snapshot.totalCount();
        int onlineDevices = snapshot.onlineCount();

        BigDecimal totalActions = BigDecimal.ZERO;
        BigDecimal tweets = BigDecimal.ZERO;
        BigDecimal replies = BigDecimal.ZERO;
        BigDecimal retweets = BigDecimal.ZERO;
        double totalUptime = 0;
        List<DeviceDetail> details = new ArrayList<>(totalDevices);

        for (DeviceStatus status : snapshot.devices().values()) {
            JsonNode actions = status.getActionsToday();
            BigDecimal deviceActions = sumActions(actions);

            tweets = tweets.add(category(actions, "tweets"));
            replies = replies.add(category(actions, "replies"));
            retweets = retweets.add(category(actions, "retweets"));
            totalActions = totalActions.add(deviceActions);
            totalUptime += ReportFields.number(status.getUptimeHours());

            details.add(new DeviceDetail(
                    status.getDeviceId(),
                    status.getDeviceId().replace("bot_", ""),
                    status.getStatus().getWireName(),
                    status.getUptimeHours(),
                    actions,
                    deviceActions,
                    status.getLastActivity(),
                    status.getCpuUsage(),
                    status.getMemoryUsage()));
        }

        // stable sort: ties keep registry (id) order
        details.sort(Comparator.comparing(DeviceDetail::totalActions).reversed());
        List<DeviceDetail> topPerformers = List.copyOf(details.subList(0, Math.min(TOP_PERFORMERS, details.size())));

        FleetOverview overview = new FleetOverview(
                totalDevices,
                onlineDevices,
                totalDevices - onlineDevices,
                totalUptime,
                ratio(totalUptime, totalDevices));

        ActionBreakdown breakdown = new ActionBreakdown(
                totalActions,
                tweets,
                replies,
                retweets,
                percentage(tweets.doubleValue(), totalActions.doubleValue()),
                percentage(replies.doubleValue(), totalActions.doubleValue()),
                percentage(retweets.doubleValue(), totalActions.doubleValue()));

        PerformanceMetrics metrics = new PerformanceMetrics(
                ratio(totalActions.doubleValue(), totalDevices),
                percentage(onlineDevices, totalDevices),
                ratio(totalActions.doubleValue(), totalUptime),
                percentage(onlineDevices, totalDevices));

        return new FleetAnalyticsDto(overview, breakdown, List.copyOf(details), metrics, topPerformers);
    }

    static BigDecimal sumActions(JsonNode actions) {
        if (actions == null || !actions.isObject()) {
            return BigDecimal.ZERO;
        }
        BigDecimal sum = BigDecimal.ZERO;
        for (Iterator<JsonNode> it = actions.elements(); it.hasNext(); ) {
            sum = sum.add(ReportFields.count(it.next()));
        }
        return sum;
    }

    private static BigDecimal category(JsonNode actions, String name) {
        if (actions == null || !actions.isObject()) {
            return BigDecimal.ZERO;
        }
        return ReportFields.count(actions.get(name));
    }

    static double ratio(double numerator, double denominator) {
        return denominator > 0 ? numerator / denominator : 0;
    }

    static double percentage(double part, double whole) {
        return ratio(part, whole) * 100;
    }
}

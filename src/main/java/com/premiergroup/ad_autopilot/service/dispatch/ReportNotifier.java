package com.premiergroup.ad_autopilot.service.dispatch;

import com.premiergroup.ad_autopilot.dto.ExecutionReport;

/**
 * Outbound channel for terminal batch reports. Called once per executed batch, never for replays.
 */
public interface ReportNotifier {

    void notify(ExecutionReport report);
}

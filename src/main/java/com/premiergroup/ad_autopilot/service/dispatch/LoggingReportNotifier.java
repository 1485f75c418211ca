package com.premiergroup.ad_autopilot.service.dispatch;

import com.premiergroup.ad_autopilot.dto.ExecutionReport;
import com.premiergroup.ad_autopilot.enums.BatchStatus;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

@Component
@Log4j2
public class LoggingReportNotifier implements ReportNotifier {

    @Override
    public void notify(ExecutionReport report) {
        if (report.status() == BatchStatus.APPLIED) {
            log.info(report.summary());
        } else {
            log.warn(report.summary());
        }
    }
}

package com.punchclock.backend.modules.attendance.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "app.attendance.disqualification.enabled", havingValue = "true", matchIfMissing = true)
public class DisqualificationScheduler {

    private static final Logger log = LoggerFactory.getLogger(DisqualificationScheduler.class);

    private final DisqualificationService disqualificationService;

    public DisqualificationScheduler(DisqualificationService disqualificationService) {
        this.disqualificationService = disqualificationService;
    }

    @Scheduled(cron = "${app.attendance.disqualification.cron:0 0 3 * * *}",
            zone = "${app.attendance.default-zone:UTC}")
    public void disqualifyOpenSessions() {
        try {
            DisqualificationService.SweepResult result = disqualificationService.runDisqualificationSweep();
            if (result.scanned() > 0) {
                log.info("Disqualified {} open sessions ({} failed)", result.disqualified(), result.failed());
            }
        } catch (Exception ex) {
            log.error("Disqualification sweep aborted", ex);
        }
    }
}

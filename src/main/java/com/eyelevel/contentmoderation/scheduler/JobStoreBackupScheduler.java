package com.eyelevel.contentmoderation.scheduler;

import com.eyelevel.contentmoderation.service.backup.JobStoreBackupService;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.moderation.backup", name = "enabled", havingValue = "true")
public class JobStoreBackupScheduler {

    private final JobStoreBackupService backupService;

    @Scheduled(cron = "${app.moderation.backup.cron:0 0 * * * *}")
    public void backupJobStore() {
        backupService.createBackup();
    }
}

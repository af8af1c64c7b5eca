package net.jobsy.core.spi;

import net.jobsy.core.exception.NotificationSendException;
import net.jobsy.core.model.Job;

import java.time.Instant;

/** Outbound failure notification to the job owner (email in production). */
public interface Notifier {
    void sendFailureNotification(Job job, Instant checkTime, Instant expectedFinish) throws NotificationSendException;
}

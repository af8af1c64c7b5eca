package net.jobsy.integration.spring.mail;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import net.jobsy.core.exception.NotificationSendException;
import net.jobsy.core.model.Job;
import net.jobsy.core.spi.Notifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;

/**
 * Failure notification as a multipart (plain text + HTML) mail to the job owner.
 */
public class MailNotifier implements Notifier {
    private static final Logger log = LoggerFactory.getLogger(MailNotifier.class);

    // e.g. "Friday 1-Mar-2024 18:01:00 AWST"
    private static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("EEEE d-MMM-yyyy HH:mm:ss z", Locale.ENGLISH);

    private final JavaMailSender mailSender;
    private final String from;
    private final ZoneId zone;

    public MailNotifier(JavaMailSender mailSender, String from, ZoneId zone) {
        this.mailSender = Objects.requireNonNull(mailSender);
        this.from = Objects.requireNonNull(from);
        this.zone = Objects.requireNonNull(zone);
    }

    @Override
    public void sendFailureNotification(Job job, Instant checkTime, Instant expectedFinish) {
        try {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, true, "UTF-8");

            helper.setFrom(from);
            helper.setTo(job.ownerEmail());
            helper.setSubject(subject(job));
            helper.setText(plainBody(job, checkTime, expectedFinish), htmlBody(job, checkTime, expectedFinish));

            mailSender.send(message);
            log.debug("Failure mail for job '{}' handed to the mail server", job.name());
        } catch (MessagingException | MailException e) {
            throw new NotificationSendException(
                    "Failed to send failure notification for job '" + job.name() + "' to " + job.ownerEmail(), e);
        }
    }

    static String subject(Job job) {
        return "JOB FAILURE NOTIFICATION: " + job.name();
    }

    String plainBody(Job job, Instant checkTime, Instant expectedFinish) {
        StringBuilder sb = new StringBuilder()
                .append("Check time: ").append(format(checkTime)).append("\n\n")
                .append("This job has exceeded its expected completion deadline: ").append(format(expectedFinish));
        if (job.hasUrl()) {
            sb.append("\nURL: ").append(job.url());
        }
        return sb.toString();
    }

    String htmlBody(Job job, Instant checkTime, Instant expectedFinish) {
        StringBuilder sb = new StringBuilder()
                .append("<p>Check time: ").append(format(checkTime)).append("</p>\n")
                .append("<p>This job has exceeded its expected completion deadline: ")
                .append(format(expectedFinish)).append("</p>");
        if (job.hasUrl()) {
            String url = escape(job.url());
            sb.append("<p>URL: <a href='").append(url).append("'>").append(url).append("</a></p>");
        }
        return sb.toString();
    }

    String format(Instant instant) {
        return FORMAT.format(instant.atZone(zone));
    }

    private static String escape(String s) {
        return s.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;")
                .replace("\"", "&quot;").replace("'", "&#39;");
    }
}

package net.jobsy.integration.spring.mail;

import jakarta.mail.Address;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;
import net.jobsy.core.exception.NotificationSendException;
import net.jobsy.core.model.Job;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSender;

import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MailNotifierTest {
    private static final Instant CHECK = Instant.parse("2024-03-01T10:30:00Z");
    private static final Instant FINISH = Instant.parse("2024-03-01T10:05:00Z");

    @Mock
    private JavaMailSender mailSender;

    private MailNotifier notifier;

    @BeforeEach
    void setUp() {
        notifier = new MailNotifier(mailSender, "noreply@example.com", ZoneId.of("UTC"));
    }

    private static Job job(String url) {
        return Job.ofNew("nightly-backup", "0 * * * *", 5, "ok", "owner@example.com", url);
    }

    @Test
    @DisplayName("Should address the owner with the failure subject")
    void sendsToOwner() throws Exception {
        when(mailSender.createMimeMessage()).thenReturn(new MimeMessage((Session) null));

        notifier.sendFailureNotification(job(null), CHECK, FINISH);

        ArgumentCaptor<MimeMessage> captor = ArgumentCaptor.forClass(MimeMessage.class);
        verify(mailSender).send(captor.capture());
        MimeMessage sent = captor.getValue();
        assertThat(sent.getSubject()).isEqualTo("JOB FAILURE NOTIFICATION: nightly-backup");
        assertThat(sent.getAllRecipients()).extracting(Address::toString).containsExactly("owner@example.com");
        assertThat(sent.getFrom()).extracting(Address::toString).containsExactly("noreply@example.com");
    }

    @Test
    void plainBodyWithoutUrl() {
        String body = notifier.plainBody(job(null), CHECK, FINISH);

        assertThat(body).isEqualTo("""
                Check time: Friday 1-Mar-2024 10:30:00 UTC

                This job has exceeded its expected completion deadline: Friday 1-Mar-2024 10:05:00 UTC""");
        assertThat(notifier.htmlBody(job(null), CHECK, FINISH)).doesNotContain("URL");
    }

    @Test
    void bodiesCarryTheUrlWhenSet() {
        Job j = job("https://ci.example.com/backup?x=1&y=2");

        assertThat(notifier.plainBody(j, CHECK, FINISH))
                .endsWith("\nURL: https://ci.example.com/backup?x=1&y=2");
        assertThat(notifier.htmlBody(j, CHECK, FINISH))
                .startsWith("<p>Check time: Friday 1-Mar-2024 10:30:00 UTC</p>")
                .contains("<p>URL: <a href='https://ci.example.com/backup?x=1&amp;y=2'>");
    }

    @Test
    void blankUrlIsIgnored() {
        assertThat(notifier.plainBody(job("  "), CHECK, FINISH)).doesNotContain("URL");
    }

    @Test
    void datesFollowTheConfiguredZone() {
        MailNotifier utcPlusEight = new MailNotifier(mailSender, "noreply@example.com", ZoneId.of("Asia/Singapore"));
        assertThat(utcPlusEight.format(CHECK)).startsWith("Friday 1-Mar-2024 18:30:00 ");
    }

    @Test
    @DisplayName("Should surface mail server errors as NotificationSendException")
    void mailErrorIsWrapped() {
        when(mailSender.createMimeMessage()).thenReturn(new MimeMessage((Session) null));
        doThrow(new MailSendException("SMTP error")).when(mailSender).send(any(MimeMessage.class));

        assertThatThrownBy(() -> notifier.sendFailureNotification(job(null), CHECK, FINISH))
                .isInstanceOf(NotificationSendException.class)
                .hasMessageContaining("nightly-backup")
                .hasCauseInstanceOf(MailSendException.class);
    }
}

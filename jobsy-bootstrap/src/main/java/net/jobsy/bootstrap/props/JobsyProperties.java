package net.jobsy.bootstrap.props;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties("jobsy")
public class JobsyProperties {
    private String zone = "UTC";
    private Scheduler scheduler = new Scheduler();
    private Notifications notifications = new Notifications();
    private Catalog catalog = new Catalog();

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Notifications getNotifications() {
        return notifications;
    }

    public void setNotifications(Notifications notifications) {
        this.notifications = notifications;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog;
    }

    public static class Scheduler {
        private boolean enabled = true;
        // 읽기 전용: 실제 주기는 @Scheduled 플레이스홀더가 같은 키에서 읽는다
        private long tickDelayMs = 60_000;
        private long initialDelayMs = 10_000;
        private int checkWorkers = 4;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getTickDelayMs() {
            return tickDelayMs;
        }

        public void setTickDelayMs(long tickDelayMs) {
            this.tickDelayMs = tickDelayMs;
        }

        public long getInitialDelayMs() {
            return initialDelayMs;
        }

        public void setInitialDelayMs(long initialDelayMs) {
            this.initialDelayMs = initialDelayMs;
        }

        public int getCheckWorkers() {
            return checkWorkers;
        }

        public void setCheckWorkers(int checkWorkers) {
            this.checkWorkers = checkWorkers;
        }
    }

    public static class Notifications {
        private boolean enabled = false;
        private String from = "noreply@localhost";
        private int maxAttempts = 3;
        private Duration retryBackoff = Duration.ofSeconds(10);
        private int sendWorkers = 2;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getFrom() {
            return from;
        }

        public void setFrom(String from) {
            this.from = from;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getRetryBackoff() {
            return retryBackoff;
        }

        public void setRetryBackoff(Duration retryBackoff) {
            this.retryBackoff = retryBackoff;
        }

        public int getSendWorkers() {
            return sendWorkers;
        }

        public void setSendWorkers(int sendWorkers) {
            this.sendWorkers = sendWorkers;
        }
    }

    public static class Catalog {
        private boolean enabled = true;
        private List<JobDef> jobs = new ArrayList<>(); // ← 가변

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<JobDef> getJobs() {
            return jobs;
        }

        public void setJobs(List<JobDef> jobs) {
            this.jobs = jobs;
        }
    }

    public static class JobDef {
        private String name;
        private String schedule;
        private int deadlineMinutes = 5;
        private String expectedStatus;
        private String owner;
        private String url;
        private boolean active = true;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getSchedule() {
            return schedule;
        }

        public void setSchedule(String schedule) {
            this.schedule = schedule;
        }

        public int getDeadlineMinutes() {
            return deadlineMinutes;
        }

        public void setDeadlineMinutes(int deadlineMinutes) {
            this.deadlineMinutes = deadlineMinutes;
        }

        public String getExpectedStatus() {
            return expectedStatus;
        }

        public void setExpectedStatus(String expectedStatus) {
            this.expectedStatus = expectedStatus;
        }

        public String getOwner() {
            return owner;
        }

        public void setOwner(String owner) {
            this.owner = owner;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public boolean isActive() {
            return active;
        }

        public void setActive(boolean active) {
            this.active = active;
        }

        @Override
        public String toString() {
            return "JobDef{" +
                    "name='" + name + '\'' +
                    ", schedule='" + schedule + '\'' +
                    ", deadlineMinutes=" + deadlineMinutes +
                    ", expectedStatus='" + expectedStatus + '\'' +
                    ", owner='" + owner + '\'' +
                    ", active=" + active +
                    '}';
        }
    }
}

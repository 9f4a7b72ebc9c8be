package net.recache.bootstrap.props;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties("recache")
public class RecacheProperties {
    private Recovery recovery = new Recovery();
    private Cleanup cleanup = new Cleanup();
    private Stale stale = new Stale();
    private Queue queue = new Queue();

    public Recovery getRecovery() {
        return recovery;
    }

    public void setRecovery(Recovery recovery) {
        this.recovery = recovery;
    }

    public Cleanup getCleanup() {
        return cleanup;
    }

    public void setCleanup(Cleanup cleanup) {
        this.cleanup = cleanup;
    }

    public Stale getStale() {
        return stale;
    }

    public void setStale(Stale stale) {
        this.stale = stale;
    }

    public Queue getQueue() {
        return queue;
    }

    public void setQueue(Queue queue) {
        this.queue = queue;
    }

    public static class Recovery {
        /** 기동 시 미완료 잡 일괄 재개 */
        private boolean onStartup = true;
        /** 잡 1건 재개 제한 시간 */
        private Duration resumeTimeout = Duration.ofMinutes(5);

        public boolean isOnStartup() {
            return onStartup;
        }

        public void setOnStartup(boolean onStartup) {
            this.onStartup = onStartup;
        }

        public Duration getResumeTimeout() {
            return resumeTimeout;
        }

        public void setResumeTimeout(Duration resumeTimeout) {
            this.resumeTimeout = resumeTimeout;
        }
    }

    public static class Cleanup {
        private boolean enabled = true;
        private int retentionDays = 30;
        // @Scheduled 는 recache.cleanup.delay-ms 를 직접 읽는다
        private long delayMs = 3_600_000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getRetentionDays() {
            return retentionDays;
        }

        public void setRetentionDays(int retentionDays) {
            this.retentionDays = retentionDays;
        }

        public long getDelayMs() {
            return delayMs;
        }

        public void setDelayMs(long delayMs) {
            this.delayMs = delayMs;
        }
    }

    public static class Stale {
        private boolean enabled = true;
        private Duration threshold = Duration.ofMinutes(30);
        private long delayMs = 600_000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getThreshold() {
            return threshold;
        }

        public void setThreshold(Duration threshold) {
            this.threshold = threshold;
        }

        public long getDelayMs() {
            return delayMs;
        }

        public void setDelayMs(long delayMs) {
            this.delayMs = delayMs;
        }
    }

    public static class Queue {
        private String routingKey = "cache.generation";

        public String getRoutingKey() {
            return routingKey;
        }

        public void setRoutingKey(String routingKey) {
            this.routingKey = routingKey;
        }
    }
}

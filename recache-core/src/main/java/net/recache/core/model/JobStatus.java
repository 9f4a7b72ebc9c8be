package net.recache.core.model;

import java.util.Locale;

/** 캐시 잡 상태. 저장소 경계에서는 code()/from()으로만 변환한다. */
public enum JobStatus {
    PENDING, RUNNING, COMPLETED, FAILED;

    public static JobStatus from(String s) {
        if (s == null) throw new IllegalArgumentException("job status code is null");
        return switch (s.trim().toUpperCase(Locale.ROOT)) {
            case "PENDING" -> PENDING;
            case "RUNNING" -> RUNNING;
            case "COMPLETED" -> COMPLETED;
            case "FAILED" -> FAILED;
            default -> throw new IllegalArgumentException("unknown job status code: " + s);
        };
    }

    public String code() { return name(); }

    /** COMPLETED만 종결 상태. FAILED는 재개 시도 사이에 RUNNING과 오갈 수 있다. */
    public boolean isTerminal() { return this == COMPLETED; }
}

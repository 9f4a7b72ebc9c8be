package net.recache.core.error;

/**
 * 복구 코디네이터가 호출자에게 알리는 실패. 협력자 예외는 항상 이 타입으로 감싼다.
 * 개별 아이템 스킵은 실패가 아니므로 여기에 없다.
 */
public class RecoveryException extends Exception {

    public enum Kind {
        /** 잡/컬렉션 레코드 없음. 자동 재시도하지 않는다 */
        NOT_FOUND,
        /** canResume=false. 예상된 영구 상태 */
        NON_RESUMABLE,
        /** 저장소/큐/컬렉션 소스 I/O 실패. 호출자가 다음 주기에 재시도 */
        COLLABORATOR_UNAVAILABLE
    }

    private final Kind kind;

    public RecoveryException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() { return kind; }

    public static RecoveryException notFound(String what) {
        return new RecoveryException(Kind.NOT_FOUND, what + " not found", null);
    }

    public static RecoveryException nonResumable(String jobId) {
        return new RecoveryException(Kind.NON_RESUMABLE, "job " + jobId + " is not resumable", null);
    }

    public static RecoveryException unavailable(String operation, Throwable cause) {
        return new RecoveryException(Kind.COLLABORATOR_UNAVAILABLE, operation + " failed: " + cause.getMessage(), cause);
    }
}

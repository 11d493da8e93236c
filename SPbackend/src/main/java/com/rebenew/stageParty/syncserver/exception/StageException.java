package com.rebenew.stageParty.syncserver.exception;

/**
 * Un comando rechazado. Se lanza antes de tocar el estado y solo se notifica a quien lo envió.
 */
public class StageException extends RuntimeException {

    private final StageErrorCode code;

    public StageException(StageErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public StageErrorCode getCode() {
        return code;
    }

    public static StageException notFound(String message) {
        return new StageException(StageErrorCode.NOT_FOUND, message);
    }

    public static StageException forbidden(String message) {
        return new StageException(StageErrorCode.FORBIDDEN, message);
    }

    public static StageException invalidOrder(String message) {
        return new StageException(StageErrorCode.INVALID_ORDER, message);
    }

    public static StageException duplicatePending(String message) {
        return new StageException(StageErrorCode.DUPLICATE_PENDING, message);
    }

    public static StageException invalidCommand(String message) {
        return new StageException(StageErrorCode.INVALID_COMMAND, message);
    }
}

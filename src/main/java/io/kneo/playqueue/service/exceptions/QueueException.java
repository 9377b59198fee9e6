package io.kneo.playqueue.service.exceptions;

import lombok.Getter;

@Getter
public class QueueException extends RuntimeException {

    @Getter
    public enum ErrorType {
        INVALID_RANGE("Bad song index"),
        NO_SUCH_ID("No such song"),
        CAPACITY_EXCEEDED("Playlist is too large"),
        END_OF_QUEUE("No further entry in the play order"),
        VERSION_TOO_OLD("Requested version is no longer retained"),
        NOT_ALLOWED("Operation is not allowed on the current entry");

        private final String defaultMessage;

        ErrorType(String defaultMessage) {
            this.defaultMessage = defaultMessage;
        }
    }

    private final ErrorType errorType;

    public QueueException(ErrorType errorType) {
        super(errorType.getDefaultMessage());
        this.errorType = errorType;
    }

    public QueueException(ErrorType errorType, String msg) {
        super(msg);
        this.errorType = errorType;
    }

    public static QueueException invalidRange(String format, Object... args) {
        return new QueueException(ErrorType.INVALID_RANGE, String.format(format, args));
    }

    public static QueueException noSuchId(int id) {
        return new QueueException(ErrorType.NO_SUCH_ID, "No such song id: " + id);
    }
}

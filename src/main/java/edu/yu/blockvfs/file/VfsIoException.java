package edu.yu.blockvfs.file;

/**
 * I/O error surfaced to the database engine by a {@link BlockFile}.
 */
public class VfsIoException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public VfsIoException(String message) {
        super(message);
    }

    public VfsIoException(String message, Throwable cause) {
        super(message, cause);
    }

}

package edu.yu.blockvfs.file;

public class CannotOpenException extends VfsIoException {

    private static final long serialVersionUID = 1L;

    public CannotOpenException(String message) {
        super(message);
    }

}

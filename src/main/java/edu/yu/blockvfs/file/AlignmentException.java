package edu.yu.blockvfs.file;

/**
 * A read crossed a block boundary or a write was not exactly one aligned block.
 */
public class AlignmentException extends VfsIoException {

    private static final long serialVersionUID = 1L;

    public AlignmentException(String message) {
        super(message);
    }

}

package edu.yu.blockvfs.file;

/**
 * A block within the file size has no cached or stored content.
 */
public class BlockNotFoundException extends VfsIoException {

    private static final long serialVersionUID = 1L;

    public BlockNotFoundException(BlockId id) {
        super("No content stored for " + id);
    }

}

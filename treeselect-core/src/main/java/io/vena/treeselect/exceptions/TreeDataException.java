package io.vena.treeselect.exceptions;

/**
 * Tree data could not be read or written in some external format.
 */
public class TreeDataException extends RuntimeException {
	public TreeDataException(String message) { super(message); }
	public TreeDataException(Throwable cause) { super(cause); }
	public TreeDataException(String message, Throwable cause) { super(message, cause); }
}

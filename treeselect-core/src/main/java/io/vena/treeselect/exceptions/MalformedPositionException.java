package io.vena.treeselect.exceptions;

public class MalformedPositionException extends IllegalArgumentException {
	public MalformedPositionException(String message) { super(message); }
	public MalformedPositionException(Throwable cause) { super(cause); }
	public MalformedPositionException(String message, Throwable cause) { super(message, cause); }
}

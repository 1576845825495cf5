package edu.upf.taln.udpas.core.pas;

import edu.upf.taln.udpas.core.structures.InvalidStructureException;

/**
 * A sentence that could not be annotated, when structural errors are configured to stop the run.
 */
public class AnnotationException extends RuntimeException
{
	private final String sentence;
	private final static long serialVersionUID = 1L;

	public AnnotationException(String sentence, InvalidStructureException cause)
	{
		super("Cannot annotate sentence " + sentence + ": " + cause.getMessage() + " " + cause.getIds(), cause);
		this.sentence = sentence;
	}

	public String getSentence() { return sentence; }
}

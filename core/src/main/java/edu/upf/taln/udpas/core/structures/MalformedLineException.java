package edu.upf.taln.udpas.core.structures;

/**
 * A node line that does not have the ten CoNLL-U columns or whose id is not a valid node id.
 */
public class MalformedLineException extends InvalidStructureException
{
	private final static long serialVersionUID = 1L;

	public MalformedLineException(String message, String id)
	{
		super(message, id);
	}
}

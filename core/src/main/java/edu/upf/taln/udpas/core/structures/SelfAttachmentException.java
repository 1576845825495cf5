package edu.upf.taln.udpas.core.structures;

public class SelfAttachmentException extends InvalidStructureException
{
	private final static long serialVersionUID = 1L;

	public SelfAttachmentException(String id)
	{
		super("Cannot attach node '" + id + "' to itself in the basic tree", id);
	}
}

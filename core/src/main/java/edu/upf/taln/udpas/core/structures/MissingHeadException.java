package edu.upf.taln.udpas.core.structures;

public class MissingHeadException extends InvalidStructureException
{
	private final static long serialVersionUID = 1L;

	public MissingHeadException(String id, String head, String relation)
	{
		super("Dependency '" + relation + "' of node '" + id + "' from a non-existent node '" + head + "'", id, head);
	}
}

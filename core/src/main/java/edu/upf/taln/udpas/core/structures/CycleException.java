package edu.upf.taln.udpas.core.structures;

public class CycleException extends InvalidStructureException
{
	private final static long serialVersionUID = 1L;

	public CycleException(String id, String head)
	{
		super("Cannot attach node '" + id + "' to '" + head + "' in the basic tree because it would make a cycle", id, head);
	}
}

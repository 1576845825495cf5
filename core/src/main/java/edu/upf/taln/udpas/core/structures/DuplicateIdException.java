package edu.upf.taln.udpas.core.structures;

public class DuplicateIdException extends InvalidStructureException
{
	private final static long serialVersionUID = 1L;

	public DuplicateIdException(String id)
	{
		super("There is already a node with ID " + id + " in the graph", id);
	}
}

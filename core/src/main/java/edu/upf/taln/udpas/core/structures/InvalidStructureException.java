package edu.upf.taln.udpas.core.structures;

import java.util.List;

/**
 * Signals a sentence whose structure cannot be represented: duplicate ids, references to unknown nodes, self
 * attachments or cycles in the basic tree. The sentence cannot be annotated.
 */
public abstract class InvalidStructureException extends RuntimeException
{
	private final List<String> ids; // offending node ids
	private final static long serialVersionUID = 1L;

	protected InvalidStructureException(String message, String... ids)
	{
		super(message);
		this.ids = List.of(ids);
	}

	public List<String> getIds() { return ids; }
}

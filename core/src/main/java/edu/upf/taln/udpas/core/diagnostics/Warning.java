package edu.upf.taln.udpas.core.diagnostics;

/**
 * Kinds of recoverable anomalies found while reading and annotating sentences.
 */
public enum Warning
{
	UNPARSABLE_FEATURE("Unrecognized feature-value pair."),
	DUPLICATE_FEATURE("Duplicate feature definition, the last value is kept."),
	UNPARSABLE_DEPENDENCY("Cannot understand enhanced dependency."),
	DUPLICATE_ENHANCED_EDGE("Ignoring repeated declaration of an enhanced edge."),
	DISCONNECTED_GRAPH("Enhanced graph has more than one component."),
	MULTIPLE_SUBJECTS("More than 1 subject, not in coordination."),
	MULTIPLE_OBJECTS("More than 1 direct object, not in coordination."),
	MULTIPLE_INDIRECT_OBJECTS("More than 1 indirect object, not in coordination."),
	MULTIPLE_AGENTS("More than 1 oblique agent, not in coordination."),
	MULTIPLE_XCOMPS("More than 1 open clausal complement, not in coordination."),
	ACTIVE_SUBJECT_IN_PASSIVE("Non-passive subject in a passive clause."),
	OBJECT_IN_PASSIVE("Direct object in a passive clause."),
	IOBJ_XCOMP_CONFLICT("Indirect object and open clausal complement in the same active clause."),
	SKIPPED_SENTENCE("Sentence skipped because of a structural error.");

	private final String message;

	Warning(String message)
	{
		this.message = message;
	}

	public String getMessage() { return message; }
}

package edu.upf.taln.udpas.core.structures;

import com.google.common.base.Splitter;

import java.util.List;

/**
 * Groups dependency relation labels (deprels) by the role they play in predicate-argument structures. A family
 * includes the universal relation and its colon-delimited subtypes, e.g. nsubj, nsubj:outer and nsubj:xsubj are
 * all SUBJECT.
 */
public enum RelationFamily
{
	SUBJECT,            // nsubj, csubj
	SUBJECT_PASSIVE,    // nsubj:pass, csubj:pass
	OBJECT,             // obj, ccomp
	IOBJ,
	XCOMP,
	OBLIQUE_AGENT,      // obl:agent
	OBLIQUE_ARGUMENT,   // obl:arg
	COORDINATION,       // conj
	COMPOUND,
	REFLEXIVE,          // expl:pv
	OTHER;

	private static final Splitter splitter = Splitter.on(':');

	public static RelationFamily of(String relation)
	{
		if (relation == null || relation.isEmpty())
			return OTHER;

		final List<String> parts = splitter.splitToList(relation);
		final String base = parts.get(0);
		final String subtype = parts.size() > 1 ? parts.get(1) : "";
		switch (base)
		{
			case "nsubj":
			case "csubj":
				return subtype.equals("pass") ? SUBJECT_PASSIVE : SUBJECT;
			case "obj":
			case "ccomp":
				return OBJECT;
			case "iobj":
				return IOBJ;
			case "xcomp":
				return XCOMP;
			case "obl":
				if (subtype.equals("agent"))
					return OBLIQUE_AGENT;
				return relation.equals("obl:arg") ? OBLIQUE_ARGUMENT : OTHER;
			case "conj":
				return COORDINATION;
			case "compound":
				return COMPOUND;
			case "expl":
				return relation.equals("expl:pv") ? REFLEXIVE : OTHER;
			default:
				return OTHER;
		}
	}

	public boolean isSubject() { return this == SUBJECT || this == SUBJECT_PASSIVE; }

	/**
	 * Relations that probably attach arguments rather than adjuncts: subjects, objects, clausal complements,
	 * and the oblique agent and argument subtypes.
	 */
	public static boolean isArgumentLike(String relation)
	{
		switch (of(relation))
		{
			case SUBJECT:
			case SUBJECT_PASSIVE:
			case OBJECT:
			case IOBJ:
			case XCOMP:
			case OBLIQUE_AGENT:
			case OBLIQUE_ARGUMENT:
				return true;
			default:
				return false;
		}
	}
}

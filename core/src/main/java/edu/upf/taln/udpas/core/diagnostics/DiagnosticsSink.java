package edu.upf.taln.udpas.core.diagnostics;

/**
 * Receives the anomalies and frequency counts produced while annotating sentences. The annotation never reads
 * anything back from a sink.
 */
public interface DiagnosticsSink
{
	void warn(Warning kind, String context);
	void increment(CounterTable table, String key);

	/**
	 * A sink that discards everything
	 */
	DiagnosticsSink NONE = new DiagnosticsSink()
	{
		@Override
		public void warn(Warning kind, String context) {}

		@Override
		public void increment(CounterTable table, String key) {}
	};
}

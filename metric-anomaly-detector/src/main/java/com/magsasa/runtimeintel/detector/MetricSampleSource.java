package com.magsasa.runtimeintel.detector;

import java.io.IOException;

/** A pull based metric feed polled on a schedule. */
public interface MetricSampleSource {

  MetricSampleParser.ParsedSamples poll() throws IOException;
}

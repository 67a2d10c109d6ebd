package ai.svcs.semantic.patterns;

import java.util.List;

/** One heuristic detector. Rules are independent; each returns its candidates unfiltered. */
public interface PatternRule {

    String name();

    List<PatternMatch> detect(PatternInput input);
}

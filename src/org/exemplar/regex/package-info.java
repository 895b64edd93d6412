/*
 * @LICENSE@
 */

/**
 * <h3><b>exemplar</b> - regular expressions from examples.</h3>
 * <p>
 * <h4>Motivation.</h4>
 * <p>
 * Writing a regular expression for a handful of known strings is tedious and
 * error prone: the obvious alternation of the strings is unreadable, and the
 * readable version is easy to get subtly wrong. <b>exemplar</b> takes the
 * strings and derives the expression, via finite automata, so the result
 * matches exactly the strings given - and is still something a person can
 * read. See {@link org.exemplar.regex.RegexBuilder} for examples.
 * <p>
 * <h4>How it works.</h4>
 * <ol>
 * <li>Each string is split into grapheme clusters ("user perceived
 * characters") - the symbols of the automaton alphabet. Optionally digits,
 * word and space characters are replaced by character classes, and repeated
 * substrings are folded into bounded repetitions.</li>
 * <li>A trie shaped DFA accepting exactly the strings is built, and then
 * minimized by partition refinement. The minimal DFA of a language is
 * unique, which is what makes the output independent of the order of the
 * input.</li>
 * <li>The minimal DFA is converted to an abstract syntax tree by state
 * elimination, simplifying as it goes: single characters merge into sets,
 * optional parts become <code>?</code>, and so on.</li>
 * <li>The tree is written out with the fewest parenthesis precedence allows,
 * and anchored.</li>
 * </ol>
 * <p>
 * <h4>References and Acknowledgements:</h4>
 * <ul>
 * <li>For an introduction to the theory behind regular expression and thier
 * implementation as automata, see the first chapters of the <a
 * href="http://en.wikipedia.org/wiki/Compilers:_Principles,_Techniques,_and_Tools">Dragon
 * Book.</a>
 * <li>State elimination, and DFA minimization, are covered in most automata
 * textbooks, e.g. Hopcroft, Motwani and Ullman, <i>Introduction to Automata
 * Theory, Languages, and Computation</i>.</li>
 * <li>Grapheme cluster boundaries are defined by <a
 * href="http://www.unicode.org/reports/tr29/">Unicode Standard Annex #29</a>,
 * and computed by <a href="http://site.icu-project.org/">ICU4J</a>.</li>
 * </ul>
 */
package org.exemplar.regex;

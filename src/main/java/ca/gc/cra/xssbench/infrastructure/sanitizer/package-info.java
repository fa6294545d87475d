/**
 * Built-in sanitizers, including the jsoup {@link org.jsoup.safety.Safelist} policy.
 */
package ca.gc.cra.xssbench.infrastructure.sanitizer;

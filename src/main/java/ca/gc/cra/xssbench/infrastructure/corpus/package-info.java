/**
 * Jackson-backed loader for vector corpus files.
 */
package ca.gc.cra.xssbench.infrastructure.corpus;

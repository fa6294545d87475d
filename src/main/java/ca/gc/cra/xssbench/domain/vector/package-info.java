/**
 * Attack vectors, the payload contexts they target and the markup shape they are expected to keep.
 */
package ca.gc.cra.xssbench.domain.vector;

package qkd.core.simulator;

/**
 * BB84 measurement bases.
 */
public enum Basis
{
  RECTILINEAR, // + (0, 90 degrees)
  DIAGONAL     // x (45, 135 degrees)
}

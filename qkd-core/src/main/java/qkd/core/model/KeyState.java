package qkd.core.model;

/**
 * Lifecycle state of a stored key. Only ACTIVE keys release their material.
 */
public enum KeyState
{
  ACTIVE,
  CONSUMED,
  EXPIRED
}

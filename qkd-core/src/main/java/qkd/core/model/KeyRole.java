package qkd.core.model;

/**
 * ETSI GS QKD 014 role of the local party for a key: the master SAE
 * originates it, the slave SAE retrieves it by id.
 */
public enum KeyRole
{
  MASTER( "master" ),
  SLAVE(  "slave"  );

  private final String label;

  KeyRole( String label )
  {
    this.label = label;
  }

  public String getLabel()
  {
    return label;
  }
}

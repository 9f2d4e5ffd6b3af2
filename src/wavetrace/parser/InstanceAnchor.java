package wavetrace.parser;

/**
 * Location of a module instantiation: the module type token used at the instantiation site and the opening
 * parenthesis of its port connection list.
 */
public class InstanceAnchor {
  private final String instanceName;
  private final String instanceType;
  private final SourceAnchor typeLocation;
  private final SourceAnchor portConnLocation;
  private final boolean emptyConnections;

  public InstanceAnchor(String instanceName, String instanceType, SourceAnchor typeLocation, SourceAnchor portConnLocation,
                        boolean emptyConnections) {
    this.instanceName = instanceName;
    this.instanceType = instanceType;
    this.typeLocation = typeLocation;
    this.portConnLocation = portConnLocation;
    this.emptyConnections = emptyConnections;
  }

  public String getInstanceName() { return instanceName; }
  public String getInstanceType() { return instanceType; }
  public SourceAnchor getTypeLocation() { return typeLocation; }
  public SourceAnchor getPortConnLocation() { return portConnLocation; }
  public boolean hasEmptyConnections() { return emptyConnections; }

  @Override
  public String toString() {
    return instanceType + " " + instanceName + " (type " + typeLocation + ", ports " + portConnLocation + ")";
  }
}

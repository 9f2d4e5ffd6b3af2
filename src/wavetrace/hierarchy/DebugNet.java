package wavetrace.hierarchy;

import wavetrace.util.NetSpec;

/**
 * One signal to capture. The vector position is assigned once by the layout and is fixed afterwards.
 */
public class DebugNet {
  private final String path;
  private final String name;
  private final String baseName;
  private final int bitWidth;
  private final boolean hasRange;
  private int vectorPosition = -1;

  /**
   * @param spec the parsed net path
   * @param hasRange true if the net is a vector referenced with an explicit range
   */
  public DebugNet(NetSpec spec, boolean hasRange) {
    this.path = spec.getPath();
    this.name = spec.getSignal();
    this.baseName = spec.getBaseName();
    this.bitWidth = spec.getBitWidth();
    this.hasRange = hasRange;
  }

  /** Full hierarchical path as given in the setup, e.g. "core0.dout[7:0]". */
  public String getPath() { return path; }
  /** Signal token including its range, as used in the generated assign statement. */
  public String getName() { return name; }
  public String getBaseName() { return baseName; }
  public int getBitWidth() { return bitWidth; }
  public boolean hasRange() { return hasRange; }

  /**
   * Bit index of this net's MSB within the top level debug vector.
   * @throws IllegalStateException if the layout has not run yet
   */
  public int getVectorPosition() {
    if (vectorPosition < 0)
      throw new IllegalStateException("Vector position of net '" + path + "' has not been assigned");
    return vectorPosition;
  }

  public boolean hasVectorPosition() { return vectorPosition >= 0; }

  void setVectorPosition(int vectorPosition) {
    if (this.vectorPosition >= 0)
      throw new IllegalStateException("Vector position of net '" + path + "' is already assigned");
    if (vectorPosition < 0)
      throw new IllegalArgumentException("Negative vector position " + vectorPosition);
    this.vectorPosition = vectorPosition;
  }

  @Override
  public String toString() {
    return path + " (" + bitWidth + " bit" + (hasVectorPosition() ? ", msb @" + vectorPosition : "") + ")";
  }
}

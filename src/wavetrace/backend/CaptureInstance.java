package wavetrace.backend;

import wavetrace.util.Verilog;

/**
 * Parameters and text of the capture module instantiated in the top level module.
 */
public class CaptureInstance {
  public static final String MODULE_NAME = "wavetrace";

  private final int dataBits;
  private final int preTrigDepth;
  private final int captDepth;
  private final long clockHz;
  private final int uartBaud;
  private final String clockNet;
  private final String resetNet;

  /**
   * @param dataBits width of the top level debug vector
   * @param preTrigDepth depth of the pre-trigger capture memory
   * @param captDepth depth of the post-trigger capture memory
   * @param clockMhz capture clock frequency in MHz
   * @param uartBaud baud rate of the readout UART
   * @param clockNet top level capture clock net
   * @param resetNet top level reset net
   */
  public CaptureInstance(int dataBits, int preTrigDepth, int captDepth, double clockMhz, int uartBaud, String clockNet,
                         String resetNet) {
    this.dataBits = dataBits;
    this.preTrigDepth = preTrigDepth;
    this.captDepth = captDepth;
    this.clockHz = Math.round(clockMhz * 1e6);
    this.uartBaud = uartBaud;
    this.clockNet = clockNet;
    this.resetNet = resetNet;
  }

  public int getDataBits() { return dataBits; }
  public long getClockHz() { return clockHz; }

  /**
   * Returns the instantiation text, one "\n" terminated line per entry.
   */
  public String toVerilog() {
    StringBuilder r = new StringBuilder();
    r.append("  ").append(MODULE_NAME).append(" #(\n");
    r.append(String.format("    .DataBits    (%d),\n", dataBits));
    r.append(String.format("    .PreTrigDepth(%d),\n", preTrigDepth));
    r.append(String.format("    .CaptDepth   (%d),\n", captDepth));
    r.append(String.format("    .ClockHz     (%d),\n", clockHz));
    r.append(String.format("    .UartBaud    (%d))\n", uartBaud));
    r.append("  ").append(MODULE_NAME).append(" (\n");
    r.append(String.format("    .clk     (%s),\n", clockNet));
    r.append(String.format("    .rst     (%s),\n", resetNet));
    r.append(String.format("    .uart_rx (%s),\n", Verilog.UART_RX));
    r.append(String.format("    .uart_tx (%s),\n", Verilog.UART_TX));
    r.append(String.format("    .din_data(%s));\n", Verilog.DEBUG_PORT));
    return r.toString();
  }
}

package logsim.devices;

import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * The closed set of device kinds. Kind-specific behaviour is dispatched by a switch over this enum in
 * {@link DeviceRegistry#evaluate(Device, Signal[])}.
 */
public enum DeviceKind {
  AND("AND", ParameterUse.INPUT_COUNT, 0, 1),
  OR("OR", ParameterUse.INPUT_COUNT, 0, 1),
  NAND("NAND", ParameterUse.INPUT_COUNT, 0, 1),
  NOR("NOR", ParameterUse.INPUT_COUNT, 0, 1),
  XOR("XOR", ParameterUse.NONE, 2, 1),
  NOT("NOT", ParameterUse.NONE, 1, 1),
  DTYPE("DTYPE", ParameterUse.NONE, 4, 2),
  SWITCH("SWITCH", ParameterUse.INITIAL_LEVEL, 0, 1),
  CLOCK("CLOCK", ParameterUse.HALF_PERIOD, 0, 1),
  LED("LED", ParameterUse.NONE, 1, 1);

  /** What the number after the kind keyword means, if one is given. */
  public enum ParameterUse {
    NONE,
    INPUT_COUNT,
    INITIAL_LEVEL,
    HALF_PERIOD
  }

  public static final int DTYPE_DATA = 0;
  public static final int DTYPE_CLK = 1;
  public static final int DTYPE_SET = 2;
  public static final int DTYPE_CLEAR = 3;
  public static final int DTYPE_Q = 0;
  public static final int DTYPE_QBAR = 1;

  private static final List<String> DTYPE_INPUTS = List.of("DATA", "CLK", "SET", "CLEAR");
  private static final List<String> DTYPE_OUTPUTS = List.of("Q", "QBAR");

  /** Spelling in the definition language. */
  public final String keyword;
  public final ParameterUse parameterUse;
  private final int fixedInputs;
  private final int outputs;

  DeviceKind(String keyword, ParameterUse parameterUse, int fixedInputs, int outputs) {
    this.keyword = keyword;
    this.parameterUse = parameterUse;
    this.fixedInputs = fixedInputs;
    this.outputs = outputs;
  }

  public static Optional<DeviceKind> fromKeyword(String keyword) {
    return Stream.of(values()).filter(kind -> kind.keyword.equals(keyword)).findAny();
  }

  /** True for the gates whose inputs are named I1..In. */
  public boolean hasNumberedInputs() { return this != DTYPE && this != SWITCH && this != CLOCK; }

  /** Number of inputs of a device of this kind created with the given parameter. */
  public int inputCount(int parameter) { return parameterUse == ParameterUse.INPUT_COUNT ? parameter : fixedInputs; }

  public int outputCount() { return outputs; }

  /** Inputs that read LOW when nothing drives them. */
  public boolean isOptionalInput(int pin) { return this == DTYPE && (pin == DTYPE_SET || pin == DTYPE_CLEAR); }

  public String inputPinName(int pin) { return this == DTYPE ? DTYPE_INPUTS.get(pin) : "I" + (pin + 1); }

  /** Name of an output pin, or empty for the single output of a one-output device. */
  public Optional<String> outputPinName(int pin) { return this == DTYPE ? Optional.of(DTYPE_OUTPUTS.get(pin)) : Optional.empty(); }

  /**
   * Resolves an input pin name.
   * @param inputCount number of inputs of the device in question
   * @return the pin index, or empty if the name does not denote one of its inputs
   */
  public Optional<Integer> inputIndex(String pinName, int inputCount) {
    if (this == DTYPE) {
      int index = DTYPE_INPUTS.indexOf(pinName);
      return index < 0 ? Optional.empty() : Optional.of(index);
    }
    Optional<Integer> number = numberedInput(pinName);
    return number.filter(n -> n >= 1 && n <= inputCount).map(n -> n - 1);
  }

  /** Resolves an output pin name; only DTYPE has named outputs. */
  public Optional<Integer> outputIndex(String pinName) {
    int index = this == DTYPE ? DTYPE_OUTPUTS.indexOf(pinName) : -1;
    return index < 0 ? Optional.empty() : Optional.of(index);
  }

  /** Returns n for a name of the form In, regardless of any device's arity. */
  public static Optional<Integer> numberedInput(String pinName) {
    if (pinName.length() < 2 || pinName.charAt(0) != 'I')
      return Optional.empty();
    for (int i = 1; i < pinName.length(); i++)
      if (!Character.isDigit(pinName.charAt(i)))
        return Optional.empty();
    try {
      return Optional.of(Integer.parseInt(pinName.substring(1)));
    } catch (NumberFormatException e) {
      return Optional.of(Integer.MAX_VALUE);
    }
  }
}

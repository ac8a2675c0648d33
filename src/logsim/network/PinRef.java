package logsim.network;

/** A pin of a device: an input or output index, depending on where it is used. */
public record PinRef(int deviceId, int pin) {}

package qkd.core.simulator;

/**
 * What the receiver observed on the simulated quantum channel: one measured
 * bit per transmitted position and the basis the receiver measured it in.
 */
public record ChannelMeasurement( byte[] receivedBits, Basis[] receiverBases )
{
}

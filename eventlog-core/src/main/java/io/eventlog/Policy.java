package io.eventlog;

/**
 * Post-commit handler that reacts to an event by issuing new commands through an
 * {@link AggregateManager}, either its own aggregate's or another one's.
 *
 * <p>This is how multi-aggregate sagas are built. The triggering event is always
 * durable before the follow-up command runs. If the follow-up fails, the trigger
 * stays in the log and the failure surfaces through the outer
 * {@link PostCommitException}; compensation has to be modelled as further
 * commands and events.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * final class ShipOnPayment implements Policy<PaymentEvent> {
 *   private final AggregateManager<Shipment, ShipmentCommand, ShipmentEvent> shipments;
 *
 *   public void handle(StoreEvent<PaymentEvent> event) {
 *     if (event.payload() instanceof PaymentEvent.Captured captured) {
 *       shipments.handleCommand(captured.shipmentId(), new ShipmentCommand.Ship());
 *     }
 *   }
 * }
 * }</pre>
 *
 * @param <E> the event type of the aggregate whose log triggers the policy
 */
public interface Policy<E> extends EventHandler<E> {
}

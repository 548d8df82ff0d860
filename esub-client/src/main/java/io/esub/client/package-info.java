/**
 * esub client: one-shot request/reply calls and persistent publish/subscribe sessions.
 *
 * <p>A persistent session owns one {@link io.esub.client.DuplexConnection} for its whole life. The
 * {@link io.esub.client.SessionDriver} puts a deadline around it, the
 * {@link io.esub.client.SubscribeSession} and {@link io.esub.client.PublishSession} speak the protocol,
 * and the {@link io.esub.client.LivenessMonitor} keeps idle subscriptions alive when messages are not
 * confirmed.
 */
package io.esub.client;

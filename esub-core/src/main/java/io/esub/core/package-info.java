/**
 * Protocol-centric core for the esub client.
 *
 * <p>This module is framework-neutral. It contains only:
 * <ul>
 *   <li>Protocol constants, paths and environment variable names</li>
 *   <li>URL builders for the one-shot and duplex endpoints</li>
 *   <li>Small immutable models (publish items, the wire envelope, subscriptions)</li>
 *   <li>The error taxonomy and the client configuration</li>
 * </ul>
 *
 * <p>Transport bindings live in {@code esub-client}.
 */
package io.esub.core;

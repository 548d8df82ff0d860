/**
 * JSON abstraction used for the publish envelope and the node info document.
 */
package io.esub.json.spi;

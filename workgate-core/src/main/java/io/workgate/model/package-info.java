/**
 * Immutable data types shared by every WorkGate component.
 */
package io.workgate.model;

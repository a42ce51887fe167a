/**
 * Live inventory of nodes and guests.
 *
 * <p>{@link org.tanzu.pvemcp.inventory.StatePoller} polls every endpoint and commits each
 * {@link org.tanzu.pvemcp.inventory.EndpointInventory} generation to the
 * {@link org.tanzu.pvemcp.inventory.InventoryStore}; {@link org.tanzu.pvemcp.inventory.SnapshotDiffer}
 * decides which differences are worth an event.
 */
package org.tanzu.pvemcp.inventory;

package org.javai.reporting.catalog;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.javai.reporting.config.CatalogSettings;

/**
 * Holds the current {@link SchemaCatalog} snapshot.
 *
 * <p>The first call to {@link #current()} introspects the data store; later calls return the same
 * snapshot until {@link #refresh()} replaces it. Callers should take one snapshot per request and use
 * it throughout, so a concurrent refresh never mixes two schemas inside one request.</p>
 */
public class SchemaCatalogProvider {

	private final SchemaIntrospector introspector;
	private final CatalogSettings settings;
	private final AtomicReference<SchemaCatalog> current = new AtomicReference<>();

	public SchemaCatalogProvider(SchemaIntrospector introspector, CatalogSettings settings) {
		this.introspector = Objects.requireNonNull(introspector, "introspector");
		this.settings = Objects.requireNonNull(settings, "settings");
	}

	public SchemaCatalog current() {
		SchemaCatalog catalog = current.get();
		if (catalog != null) {
			return catalog;
		}
		synchronized (this) {
			catalog = current.get();
			if (catalog == null) {
				catalog = SchemaCatalog.build(introspector, settings);
				current.set(catalog);
			}
			return catalog;
		}
	}

	/**
	 * Introspects again and swaps in the new snapshot. Snapshots already handed out are unaffected.
	 */
	public synchronized SchemaCatalog refresh() {
		SchemaCatalog catalog = SchemaCatalog.build(introspector, settings);
		current.set(catalog);
		return catalog;
	}
}

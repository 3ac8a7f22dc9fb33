package no.cantara.registry;

import no.cantara.registry.model.Package;
import no.cantara.registry.model.PackageSummary;
import no.cantara.registry.model.ResultSet;

import java.util.Comparator;
import java.util.List;

/**
 * Orders selected packages and projects them into a {@link ResultSet}.
 *
 * <p>The order is the textual order of {@code name@version}, which is stable for any
 * input order.
 */
public final class ResultFormatter {

    static final Comparator<Package> KEY_ORDER = Comparator.comparing(Package::key);

    private ResultFormatter() {}

    public static ResultSet format(List<Package> selected) {
        return new ResultSet(selected.stream()
                .sorted(KEY_ORDER)
                .map(PackageSummary::of)
                .toList());
    }
}

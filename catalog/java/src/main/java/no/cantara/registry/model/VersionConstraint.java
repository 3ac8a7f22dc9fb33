package no.cantara.registry.model;

import com.vdurmont.semver4j.Requirement;
import com.vdurmont.semver4j.SemverException;
import no.cantara.registry.MalformedVersionException;

/**
 * An npm-style version range such as {@code ^7.0.0}, {@code ~7.2.0},
 * {@code >=7.0.0 <8.0.0} or {@code 6.8.0 || ^7.0.0}.
 */
public final class VersionConstraint {

    private final String expression;
    private final Requirement requirement;

    private VersionConstraint(String expression, Requirement requirement) {
        this.expression = expression;
        this.requirement = requirement;
    }

    /**
     * @throws MalformedVersionException if the expression is blank or not a valid range
     */
    public static VersionConstraint parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new MalformedVersionException(String.valueOf(expression), null);
        }
        try {
            return new VersionConstraint(expression.trim(), Requirement.buildNPM(expression.trim()));
        } catch (SemverException e) {
            throw new MalformedVersionException(expression, e);
        } catch (NumberFormatException | IndexOutOfBoundsException e) {
            throw new MalformedVersionException(expression, e);
        }
    }

    public boolean isSatisfiedBy(Version version) {
        return requirement.isSatisfiedBy(version.semver());
    }

    public String expression() {
        return expression;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof VersionConstraint that && expression.equals(that.expression);
    }

    @Override
    public int hashCode() {
        return expression.hashCode();
    }

    @Override
    public String toString() {
        return expression;
    }
}

package org.silica.compiler.elaboration;

/**
 * Per-instantiation settings for binding parameters.
 *
 * @param instanceContext    Where instance assignments are resolved, or {@code null} to resolve them lazily.
 * @param overrides          Values forced from outside, never {@code null}.
 * @param forceInvalidValues Give every non-local parameter an error value or type, used when the
 *                           instantiation itself is already erroneous.
 * @param suppressErrors     Do not report missing parameter values; they still count as errors.
 */
public record ElaborationContext(
        ASTContext instanceContext,
        ParameterOverrides overrides,
        boolean forceInvalidValues,
        boolean suppressErrors
) {

    public ElaborationContext {
        if (overrides == null) {
            overrides = ParameterOverrides.empty();
        }
    }

    public static ElaborationContext of(ASTContext instanceContext) {
        return new ElaborationContext(instanceContext, ParameterOverrides.empty(), false, false);
    }

    public ElaborationContext withOverrides(ParameterOverrides newOverrides) {
        return new ElaborationContext(instanceContext, newOverrides, forceInvalidValues, suppressErrors);
    }

    public ElaborationContext withForceInvalidValues(boolean value) {
        return new ElaborationContext(instanceContext, overrides, value, suppressErrors);
    }

    public ElaborationContext withSuppressErrors(boolean value) {
        return new ElaborationContext(instanceContext, overrides, forceInvalidValues, value);
    }
}

package io.cfgtypes.generator;

import io.cfgtypes.generator.builder.BuilderModel;
import io.cfgtypes.generator.model.TypeModel;

/**
 * Turns the generated model into host-language artifacts. Implementations decide how
 * capabilities, refinements and builder protocols are spelled in the target type system.
 *
 * @param <T> the rendered artifact
 */
@FunctionalInterface
public interface ModelRenderer<T> {
  T render(TypeModel types, BuilderModel builders);
}

package agentic.ir;

import java.util.function.Function;

/** Configuration string that is either literal or read from the environment by the driver. */
public sealed interface ConfigValue permits ConfigValue.Literal, ConfigValue.Env {

    String resolve(Function<String, String> environment);

    static ConfigValue literal(String value) {
        return new Literal(value);
    }

    record Literal(String value) implements ConfigValue {
        @Override
        public String resolve(Function<String, String> environment) {
            return value;
        }
    }

    record Env(String variable) implements ConfigValue {
        @Override
        public String resolve(Function<String, String> environment) {
            return environment.apply(variable);
        }
    }
}

package skein;

import com.google.auto.value.AutoValue;
import com.google.common.base.Verify;

@AutoValue
public abstract class Value {
  public abstract ValueType type();

  // Double, String or Boolean, matching type().
  abstract Object raw();

  public static Value number(double value) {
    return new AutoValue_Value(ValueType.NUMBER, value);
  }

  public static Value string(String value) {
    return new AutoValue_Value(ValueType.STRING, value);
  }

  public static Value bool(boolean value) {
    return new AutoValue_Value(ValueType.BOOLEAN, value);
  }

  public double asNumber() {
    Verify.verify(type() == ValueType.NUMBER, "not a number: %s", this);
    return (Double) raw();
  }

  public String asString() {
    Verify.verify(type() == ValueType.STRING, "not a string: %s", this);
    return (String) raw();
  }

  public boolean asBool() {
    Verify.verify(type() == ValueType.BOOLEAN, "not a bool: %s", this);
    return (Boolean) raw();
  }

  @Override
  public String toString() {
    switch (type()) {
      case NUMBER:
        double number = asNumber();
        if (number == Math.rint(number) && !Double.isInfinite(number)) {
          return Long.toString((long) number);
        }
        return Double.toString(number);
      case STRING:
        return '"' + asString() + '"';
      case BOOLEAN:
        return Boolean.toString(asBool());
    }
    throw new AssertionError(type());
  }
}

package formlang;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Arena of states addressed by non-negative integer handles.
 *
 * <p>A state may carry a user-visible value. Looking a state up by value is
 * idempotent: the same (equal) value always maps back to the same handle.
 * States without a value are displayed by their handle. Handles are never
 * reused, and registering a handle that is already present is a no-op.
 */
public final class StateRegistry {

  // Handle to (possibly null) value, in registration order
  private final LinkedHashMap<Integer, Object> values = new LinkedHashMap<>();
  private final Map<Object, Integer> handles = new HashMap<>();
  private int nextHandle = 0;

  /**
   * Register a handle (no-op if already present).
   *
   * @param handle state handle
   * @return whether the handle was new
   */
  public boolean register(int handle) {
    if (handle < 0) {
      throw new IllegalArgumentException("state handles are non-negative, got " + handle);
    }
    if (values.containsKey(handle)) {
      return false;
    }
    values.put(handle, null);
    nextHandle = Math.max(nextHandle, handle + 1);
    return true;
  }

  /**
   * Look up (or register) the state carrying a value.
   *
   * @param value user-visible value of the state
   * @return handle of the state
   */
  public int state(Object value) {
    final Integer existing = handles.get(value);
    if (existing != null) {
      return existing;
    }
    final int handle = freshState();
    values.put(handle, value);
    handles.put(value, handle);
    return handle;
  }

  /**
   * Summon a fresh state identifier.
   *
   * @return fresh state handle
   */
  public int freshState() {
    final int handle = nextHandle++;
    values.put(handle, null);
    return handle;
  }

  public boolean contains(int handle) {
    return values.containsKey(handle);
  }

  /**
   * Value attached to a state, or {@code null} if it has none.
   */
  public Object value(int handle) {
    return values.get(handle);
  }

  /**
   * Display name of the state: its value if present, otherwise its handle.
   */
  public String name(int handle) {
    final Object value = values.get(handle);
    return value == null ? Integer.toString(handle) : value.toString();
  }

  /**
   * All handles, in registration order.
   */
  public Set<Integer> handles() {
    return Collections.unmodifiableSet(values.keySet());
  }

  public int size() {
    return values.size();
  }

  public StateRegistry copy() {
    final var copy = new StateRegistry();
    copy.values.putAll(values);
    copy.handles.putAll(handles);
    copy.nextHandle = nextHandle;
    return copy;
  }
}

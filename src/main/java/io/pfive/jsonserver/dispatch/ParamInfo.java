// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.jsonserver.dispatch;

import java.lang.reflect.Type;

/// One named parameter of an exposed method: the JSON key the client must send and the Java type
/// its value is decoded into.
public record ParamInfo (String name, Type type) { }

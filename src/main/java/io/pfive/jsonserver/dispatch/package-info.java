// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

/// Transport-independent method dispatch: registries describing what an actor type exposes, and
/// the dispatcher that turns a method name plus JSON parameters into a JSON result.
package io.pfive.jsonserver.dispatch;

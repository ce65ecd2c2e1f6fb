// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

/// This package contains the HTTP transport as a chain of Jetty handlers: exception mapping,
/// CORS, then dispatch. Documentation on the Handler programming interface:
/// https://eclipse.dev/jetty/documentation/jetty-12/programming-guide/index.html#pg-server-http-handler-impl-request
package io.pfive.jsonserver.http.handler;

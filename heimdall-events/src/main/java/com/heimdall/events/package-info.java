/**
 * In-process publish/subscribe: {@link com.heimdall.events.EventBus}, envelopes, topic patterns and the
 * {@link com.heimdall.events.AsyncDispatcher} seam the executor plugs into.
 */
package com.heimdall.events;

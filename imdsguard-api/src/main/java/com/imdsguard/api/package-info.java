/**
 * Contracts the proxy consumes but does not implement: deciding which role a workload may use, and issuing
 * credentials for a role.
 */
package com.imdsguard.api;

/**
 * Graceful whole-system restart with phase-by-phase progress events.
 */
package com.phillippitts.newwork.service.restart;

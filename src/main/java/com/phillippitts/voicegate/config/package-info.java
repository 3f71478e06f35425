/**
 * Spring configuration: executors, shared clients, typed properties and request logging.
 */
package com.phillippitts.voicegate.config;

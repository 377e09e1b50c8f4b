/**
 * REST controllers for the local control API.
 */
package com.phillippitts.speakstream.presentation.controller;

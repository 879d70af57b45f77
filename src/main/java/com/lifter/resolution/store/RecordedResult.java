package com.lifter.resolution.store;

import com.lifter.resolution.core.model.Lifter;
import com.lifter.resolution.core.model.MeetResult;

/**
 * What {@link LifterRepository#recordResult} wrote.
 *
 * @param lifter        the persisted lifter the result belongs to
 * @param result        the stored result
 * @param lifterCreated whether the lifter was created by this call
 * @param resultCreated whether a new result was inserted, false when an existing one was reused
 */
public record RecordedResult(Lifter lifter, MeetResult result, boolean lifterCreated, boolean resultCreated) {
}

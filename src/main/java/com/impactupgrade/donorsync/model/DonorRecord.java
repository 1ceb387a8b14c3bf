/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.model;

import com.google.common.base.Strings;

import java.time.LocalDate;
import java.util.Objects;

import static com.impactupgrade.donorsync.util.Utils.standardize;

/**
 * A normalized donor visit from the uploaded batch. Fields whose source column was not mapped stay null.
 */
public class DonorRecord {

  public static final String KEY_SEPARATOR = "_";

  // opaque text, never compared numerically
  public String donorNumber;
  public String firstName = "";
  public String lastName = "";
  public String email;
  public String phone;
  public String account;
  public String zipCode;
  public String status;
  public String facility;
  public String address;
  public String city;
  // ISO yyyy-MM-dd when parseable, otherwise the original text
  public String birthdate;
  // only used to pick the most recent visit within a batch
  public LocalDate lastDonationDate;

  public DonorRecord() {}

  public DonorRecord(String donorNumber, String facility) {
    this.donorNumber = donorNumber;
    this.facility = facility;
  }

  public boolean isKeyable() {
    return !Strings.isNullOrEmpty(donorNumber) && !Strings.isNullOrEmpty(facility);
  }

  public String compositeKey() {
    return compositeKey(donorNumber, facility);
  }

  public static String compositeKey(String donorNumber, String facilityOrCenter) {
    return donorNumber + KEY_SEPARATOR + facilityOrCenter;
  }

  /**
   * The composite key as used for joining: the facility part is standardized, so "Center A" and "CENTER A " are the
   * same center.
   */
  public String matchKey() {
    return matchKey(donorNumber, facility);
  }

  public static String matchKey(String donorNumber, String facilityOrCenter) {
    return compositeKey(donorNumber, standardize(facilityOrCenter));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    DonorRecord that = (DonorRecord) o;
    return Objects.equals(donorNumber, that.donorNumber) && Objects.equals(firstName, that.firstName)
        && Objects.equals(lastName, that.lastName) && Objects.equals(email, that.email)
        && Objects.equals(phone, that.phone) && Objects.equals(account, that.account)
        && Objects.equals(zipCode, that.zipCode) && Objects.equals(status, that.status)
        && Objects.equals(facility, that.facility) && Objects.equals(address, that.address)
        && Objects.equals(city, that.city) && Objects.equals(birthdate, that.birthdate)
        && Objects.equals(lastDonationDate, that.lastDonationDate);
  }

  @Override
  public int hashCode() {
    return Objects.hash(donorNumber, firstName, lastName, email, phone, account, zipCode, status, facility, address,
        city, birthdate, lastDonationDate);
  }

  @Override
  public String toString() {
    return "DonorRecord{" + compositeKey() + ", " + firstName + " " + lastName + "}";
  }
}

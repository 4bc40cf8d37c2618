package com.herzen.assurance.fragment;

import com.herzen.assurance.fragment.FragmentModels.Fragment;

@FunctionalInterface
public interface FragmentRule {
    boolean check(FragmentStore store, Fragment fragment);
}
